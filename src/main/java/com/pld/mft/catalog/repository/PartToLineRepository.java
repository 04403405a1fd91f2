package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToLineId;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartToLineRepository extends JpaRepository<PartToLine, PartToLineId> {

  boolean existsByIdPartId(String partId);

  boolean existsByIdLineId(String lineId);

  List<PartToLine> findByIdPartId(String partId);
}
