package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.Part;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartRepository extends JpaRepository<Part, String> {

  boolean existsBySupplierId(String supplierId);

  Optional<Part> findFirstByPartNumber(String partNumber);
}
