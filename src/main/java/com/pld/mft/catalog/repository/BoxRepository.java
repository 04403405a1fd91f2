package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.Box;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BoxRepository extends JpaRepository<Box, String> {

  Optional<Box> findFirstByBoxNumber(String boxNumber);
}
