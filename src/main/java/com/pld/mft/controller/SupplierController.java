package com.pld.mft.controller;

import com.pld.mft.catalog.dto.SupplierRequest;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.mapper.CatalogRequestMapper;
import com.pld.mft.catalog.service.SupplierService;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/suppliers")
@RequiredArgsConstructor
public class SupplierController {

  private final SupplierService supplierService;
  private final CatalogRequestMapper mapper;

  @GetMapping
  public List<Supplier> list() {
    return supplierService.findAll();
  }

  @GetMapping("/{supplierId}")
  public Supplier get(@PathVariable String supplierId) {
    return supplierService.get(supplierId);
  }

  @PostMapping
  public ResponseEntity<Supplier> create(@RequestBody SupplierRequest request) {
    Supplier created = supplierService.create(mapper.toSupplier(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{supplierId}")
  public Supplier update(@PathVariable String supplierId, @RequestBody SupplierRequest request) {
    return supplierService.update(mapper.toSupplier(request, supplierId));
  }

  @DeleteMapping("/{supplierId}")
  public ResponseEntity<Void> delete(@PathVariable String supplierId) {
    supplierService.delete(supplierId);
    return ResponseEntity.noContent().build();
  }
}
