package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.BoxToPalletId;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BoxToPalletRepository extends JpaRepository<BoxToPallet, BoxToPalletId> {

  boolean existsByIdBoxId(String boxId);

  boolean existsByIdPalletId(String palletId);

  List<BoxToPallet> findByIdBoxId(String boxId);
}
