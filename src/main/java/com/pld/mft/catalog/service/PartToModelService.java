package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.PartToModelId;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToModelRepository;
import com.pld.mft.catalog.repository.VehicleModelRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartToModelService extends ConstrainedTableService<PartToModel, PartToModelId> {

  private final PartToModelRepository partToModelRepository;
  private final PartRepository partRepository;
  private final VehicleModelRepository modelRepository;

  public PartToModelService(
      PartToModelRepository partToModelRepository,
      PartRepository partRepository,
      VehicleModelRepository modelRepository) {
    super(partToModelRepository, PartToModel.TABLE);
    this.partToModelRepository = partToModelRepository;
    this.partRepository = partRepository;
    this.modelRepository = modelRepository;
  }

  @Transactional(readOnly = true)
  public List<PartToModel> findByPart(String partId) {
    return partToModelRepository.findByIdPartId(partId);
  }

  @Override
  protected PartToModelId idOf(PartToModel row) {
    return row.getId();
  }

  @Override
  protected void checkKey(PartToModelId id) {
    requireKey(PartToModel.TABLE, "part_id", id == null ? null : id.getPartId());
    requireKey(PartToModel.TABLE, "model_id", id.getModelId());
  }

  @Override
  protected void enforceConstraints(PartToModel row) {
    requireLength(PartToModel.TABLE, "configuration", row.getConfiguration(), 20);
    requireReference(
        partRepository, row.getId().getPartId(), PartToModel.TABLE, "part_id", Part.TABLE);
    requireReference(
        modelRepository,
        row.getId().getModelId(),
        PartToModel.TABLE,
        "model_id",
        VehicleModel.TABLE);
  }
}
