package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBoxId;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartToBoxRepository extends JpaRepository<PartToBox, PartToBoxId> {

  boolean existsByIdPartId(String partId);

  boolean existsByIdBoxId(String boxId);

  List<PartToBox> findByIdPartId(String partId);
}
