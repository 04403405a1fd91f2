package com.pld.mft.catalog.service;

import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.Pallet;
import com.pld.mft.catalog.repository.BoxToPalletRepository;
import com.pld.mft.catalog.repository.PalletRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PalletService extends PackagingService<Pallet> {

  private final PalletRepository palletRepository;
  private final BoxToPalletRepository boxToPalletRepository;
  private final IdGenerator idGenerator;

  public PalletService(
      PalletRepository palletRepository,
      BoxToPalletRepository boxToPalletRepository,
      IdGenerator idGenerator) {
    super(palletRepository, Pallet.TABLE, Pallet::getPalletId);
    this.palletRepository = palletRepository;
    this.boxToPalletRepository = boxToPalletRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Pallet> findByNumber(String palletNumber) {
    return palletRepository.findFirstByPalletNumber(palletNumber);
  }

  @Override
  protected void applyDefaults(Pallet row) {
    super.applyDefaults(row);
    if (row.getPalletId() == null) {
      row.setPalletId(idGenerator.newUniqueId(IdGenerator.PALLET, palletRepository::existsById));
    }
  }

  @Override
  protected String idColumn() {
    return "pallet_id";
  }

  @Override
  protected List<String> referencingTables(String id) {
    List<String> tables = new ArrayList<>();
    if (boxToPalletRepository.existsByIdPalletId(id)) {
      tables.add(BoxToPallet.TABLE);
    }
    return tables;
  }
}
