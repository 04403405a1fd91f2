package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;

import com.pld.mft.catalog.domain.ModelCode;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.repository.PartToModelRepository;
import com.pld.mft.catalog.repository.VehicleModelRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class VehicleModelService extends ConstrainedTableService<VehicleModel, String> {

  private final VehicleModelRepository modelRepository;
  private final PartToModelRepository partToModelRepository;
  private final IdGenerator idGenerator;

  public VehicleModelService(
      VehicleModelRepository modelRepository,
      PartToModelRepository partToModelRepository,
      IdGenerator idGenerator) {
    super(modelRepository, VehicleModel.TABLE);
    this.modelRepository = modelRepository;
    this.partToModelRepository = partToModelRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<VehicleModel> findByCode(ModelCode code) {
    return modelRepository.findFirstByModelCode(code);
  }

  @Override
  protected void applyDefaults(VehicleModel row) {
    if (row.getModelId() == null) {
      row.setModelId(idGenerator.newUniqueId(IdGenerator.MODEL, modelRepository::existsById));
    }
  }

  @Override
  protected String idOf(VehicleModel row) {
    return row.getModelId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(VehicleModel.TABLE, "model_id", id);
  }

  // Code and name are typed enums; out-of-domain strings fail when they are parsed.
  @Override
  protected void enforceConstraints(VehicleModel row) {}

  @Override
  protected List<String> referencingTables(String id) {
    return partToModelRepository.existsByIdModelId(id) ? List.of(PartToModel.TABLE) : List.of();
  }
}
