package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.ProductionLine;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductionLineRepository extends JpaRepository<ProductionLine, String> {

  boolean existsByWorkshopId(String workshopId);

  Optional<ProductionLine> findFirstByLineCodeAndWorkshopId(String lineCode, String workshopId);
}
