package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBoxId;
import com.pld.mft.catalog.repository.BoxRepository;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.PartToBoxRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartToBoxService extends ConstrainedTableService<PartToBox, PartToBoxId> {

  private final PartToBoxRepository partToBoxRepository;
  private final PartRepository partRepository;
  private final BoxRepository boxRepository;

  public PartToBoxService(
      PartToBoxRepository partToBoxRepository,
      PartRepository partRepository,
      BoxRepository boxRepository) {
    super(partToBoxRepository, PartToBox.TABLE);
    this.partToBoxRepository = partToBoxRepository;
    this.partRepository = partRepository;
    this.boxRepository = boxRepository;
  }

  @Transactional(readOnly = true)
  public List<PartToBox> findByPart(String partId) {
    return partToBoxRepository.findByIdPartId(partId);
  }

  @Override
  protected PartToBoxId idOf(PartToBox row) {
    return row.getId();
  }

  @Override
  protected void checkKey(PartToBoxId id) {
    requireKey(PartToBox.TABLE, "part_id", id == null ? null : id.getPartId());
    requireKey(PartToBox.TABLE, "box_id", id.getBoxId());
  }

  @Override
  protected void enforceConstraints(PartToBox row) {
    requireReference(
        partRepository, row.getId().getPartId(), PartToBox.TABLE, "part_id", Part.TABLE);
    requireReference(boxRepository, row.getId().getBoxId(), PartToBox.TABLE, "box_id", Box.TABLE);
  }
}
