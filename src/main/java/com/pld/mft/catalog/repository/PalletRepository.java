package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.Pallet;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PalletRepository extends JpaRepository<Pallet, String> {

  Optional<Pallet> findFirstByPalletNumber(String palletNumber);
}
