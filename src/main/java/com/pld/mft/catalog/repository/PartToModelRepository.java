package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.PartToModelId;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartToModelRepository extends JpaRepository<PartToModel, PartToModelId> {

  boolean existsByIdPartId(String partId);

  boolean existsByIdModelId(String modelId);

  List<PartToModel> findByIdPartId(String partId);
}
