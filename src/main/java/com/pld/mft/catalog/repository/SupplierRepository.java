package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.Supplier;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SupplierRepository extends JpaRepository<Supplier, String> {

  Optional<Supplier> findFirstBySupplierName(String supplierName);
}
