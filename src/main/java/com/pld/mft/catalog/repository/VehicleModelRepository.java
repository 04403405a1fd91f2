package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.entity.VehicleModel;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleModelRepository extends JpaRepository<VehicleModel, String> {

  Optional<VehicleModel> findFirstByModelCode(ModelCode modelCode);
}
