package com.pld.mft.controller;

import com.pld.mft.catalog.dto.BoxPalletRequest;
import com.pld.mft.catalog.dto.PackagingRequest;
import com.pld.mft.catalog.entity.Box;
import com.pld.mft.catalog.entity.BoxToPallet;
import com.pld.mft.catalog.entity.BoxToPalletId;
import com.pld.mft.catalog.entity.Pallet;
import com.pld.mft.catalog.mapper.CatalogRequestMapper;
import com.pld.mft.catalog.service.BoxService;
import com.pld.mft.catalog.service.BoxToPalletService;
import com.pld.mft.catalog.service.PalletService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PackagingController {

  private final BoxService boxService;
  private final PalletService palletService;
  private final BoxToPalletService boxToPalletService;
  private final CatalogRequestMapper mapper;

  @GetMapping("/api/boxes")
  public List<Box> listBoxes() {
    return boxService.findAll();
  }

  @GetMapping("/api/boxes/{boxId}")
  public Box getBox(@PathVariable String boxId) {
    return boxService.get(boxId);
  }

  @PostMapping("/api/boxes")
  public ResponseEntity<Box> createBox(@RequestBody PackagingRequest request) {
    Box created = boxService.create(mapper.toBox(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/boxes/{boxId}")
  public Box updateBox(@PathVariable String boxId, @RequestBody PackagingRequest request) {
    return boxService.update(mapper.toBox(request, boxId));
  }

  @DeleteMapping("/api/boxes/{boxId}")
  public ResponseEntity<Void> deleteBox(@PathVariable String boxId) {
    boxService.delete(boxId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/pallets")
  public List<Pallet> listPallets() {
    return palletService.findAll();
  }

  @GetMapping("/api/pallets/{palletId}")
  public Pallet getPallet(@PathVariable String palletId) {
    return palletService.get(palletId);
  }

  @PostMapping("/api/pallets")
  public ResponseEntity<Pallet> createPallet(@RequestBody PackagingRequest request) {
    Pallet created = palletService.create(mapper.toPallet(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/pallets/{palletId}")
  public Pallet updatePallet(
      @PathVariable String palletId, @RequestBody PackagingRequest request) {
    return palletService.update(mapper.toPallet(request, palletId));
  }

  @DeleteMapping("/api/pallets/{palletId}")
  public ResponseEntity<Void> deletePallet(@PathVariable String palletId) {
    palletService.delete(palletId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/boxes/{boxId}/pallets")
  public List<BoxToPallet> listPalletsOfBox(@PathVariable String boxId) {
    return boxToPalletService.findByBox(boxId);
  }

  @PostMapping("/api/boxes/{boxId}/pallets")
  public ResponseEntity<BoxToPallet> addPallet(
      @PathVariable String boxId, @RequestBody BoxPalletRequest request) {
    BoxToPallet created = boxToPalletService.create(mapper.toBoxToPallet(boxId, null, request));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/boxes/{boxId}/pallets/{palletId}")
  public BoxToPallet updatePalletOfBox(
      @PathVariable String boxId,
      @PathVariable String palletId,
      @RequestBody BoxPalletRequest request) {
    return boxToPalletService.update(mapper.toBoxToPallet(boxId, palletId, request));
  }

  @DeleteMapping("/api/boxes/{boxId}/pallets/{palletId}")
  public ResponseEntity<Void> removePallet(
      @PathVariable String boxId, @PathVariable String palletId) {
    boxToPalletService.delete(new BoxToPalletId(boxId, palletId));
    return ResponseEntity.noContent().build();
  }
}
