package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireReference;

import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.BoxToPalletId;
import com.pld.mft.catalog.entity.Pallet;
import com.pld.mft.catalog.repository.BoxRepository;
import com.pld.mft.catalog.repository.BoxToPalletRepository;
import com.pld.mft.catalog.repository.PalletRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoxToPalletService extends ConstrainedTableService<BoxToPallet, BoxToPalletId> {

  private final BoxToPalletRepository boxToPalletRepository;
  private final BoxRepository boxRepository;
  private final PalletRepository palletRepository;

  public BoxToPalletService(
      BoxToPalletRepository boxToPalletRepository,
      BoxRepository boxRepository,
      PalletRepository palletRepository) {
    super(boxToPalletRepository, BoxToPallet.TABLE);
    this.boxToPalletRepository = boxToPalletRepository;
    this.boxRepository = boxRepository;
    this.palletRepository = palletRepository;
  }

  @Transactional(readOnly = true)
  public List<BoxToPallet> findByBox(String boxId) {
    return boxToPalletRepository.findByIdBoxId(boxId);
  }

  @Override
  protected BoxToPalletId idOf(BoxToPallet row) {
    return row.getId();
  }

  @Override
  protected void checkKey(BoxToPalletId id) {
    requireKey(BoxToPallet.TABLE, "box_id", id == null ? null : id.getBoxId());
    requireKey(BoxToPallet.TABLE, "pallet_id", id.getPalletId());
  }

  @Override
  protected void enforceConstraints(BoxToPallet row) {
    requireReference(
        boxRepository, row.getId().getBoxId(), BoxToPallet.TABLE, "box_id", Box.TABLE);
    requireReference(
        palletRepository, row.getId().getPalletId(), BoxToPallet.TABLE, "pallet_id", Pallet.TABLE);
  }
}
