package com.pld.mft.catalog.service;

import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.repository.BoxRepository;
import com.pld.mft.catalog.repository.BoxToPalletRepository;
import com.pld.mft.catalog.repository.PartToBoxRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoxService extends PackagingService<Box> {

  private final BoxRepository boxRepository;
  private final PartToBoxRepository partToBoxRepository;
  private final BoxToPalletRepository boxToPalletRepository;
  private final IdGenerator idGenerator;

  public BoxService(
      BoxRepository boxRepository,
      PartToBoxRepository partToBoxRepository,
      BoxToPalletRepository boxToPalletRepository,
      IdGenerator idGenerator) {
    super(boxRepository, Box.TABLE, Box::getBoxId);
    this.boxRepository = boxRepository;
    this.partToBoxRepository = partToBoxRepository;
    this.boxToPalletRepository = boxToPalletRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Box> findByNumber(String boxNumber) {
    return boxRepository.findFirstByBoxNumber(boxNumber);
  }

  @Override
  protected void applyDefaults(Box row) {
    super.applyDefaults(row);
    if (row.getBoxId() == null) {
      row.setBoxId(idGenerator.newUniqueId(IdGenerator.BOX, boxRepository::existsById));
    }
  }

  @Override
  protected String idColumn() {
    return "box_id";
  }

  @Override
  protected List<String> referencingTables(String id) {
    List<String> tables = new ArrayList<>();
    if (partToBoxRepository.existsByIdBoxId(id)) {
      tables.add(PartToBox.TABLE);
    }
    if (boxToPalletRepository.existsByIdBoxId(id)) {
      tables.add(BoxToPallet.TABLE);
    }
    return tables;
  }
}
