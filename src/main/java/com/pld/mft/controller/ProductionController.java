package com.pld.mft.controller;

import com.pld.mft.catalog.dto.ProductionLineRequest;
import com.pld.mft.catalog.dto.VehicleModelRequest;
import com.pld.mft.catalog.dto.WorkshopRequest;
import com.pld.mft.catalog.entity.ProductionLine;
import com.pld.mft.catalog.entity.VehicleModel;
import com.pld.mft.catalog.entity.Workshop;
import com.pld.mft.catalog.mapper.CatalogRequestMapper;
import com.pld.mft.catalog.service.ProductionLineService;
import com.pld.mft.catalog.service.VehicleModelService;
import com.pld.mft.catalog.service.WorkshopService;
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

/** Vehicle models, workshops and production lines. */
@RestController
@RequiredArgsConstructor
public class ProductionController {

  private final VehicleModelService modelService;
  private final WorkshopService workshopService;
  private final ProductionLineService lineService;
  private final CatalogRequestMapper mapper;

  @GetMapping("/api/models")
  public List<VehicleModel> listModels() {
    return modelService.findAll();
  }

  @GetMapping("/api/models/{modelId}")
  public VehicleModel getModel(@PathVariable String modelId) {
    return modelService.get(modelId);
  }

  @PostMapping("/api/models")
  public ResponseEntity<VehicleModel> createModel(@RequestBody VehicleModelRequest request) {
    VehicleModel created = modelService.create(mapper.toModel(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/models/{modelId}")
  public VehicleModel updateModel(
      @PathVariable String modelId, @RequestBody VehicleModelRequest request) {
    return modelService.update(mapper.toModel(request, modelId));
  }

  @DeleteMapping("/api/models/{modelId}")
  public ResponseEntity<Void> deleteModel(@PathVariable String modelId) {
    modelService.delete(modelId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/workshops")
  public List<Workshop> listWorkshops() {
    return workshopService.findAll();
  }

  @GetMapping("/api/workshops/{workshopId}")
  public Workshop getWorkshop(@PathVariable String workshopId) {
    return workshopService.get(workshopId);
  }

  @PostMapping("/api/workshops")
  public ResponseEntity<Workshop> createWorkshop(@RequestBody WorkshopRequest request) {
    Workshop created = workshopService.create(mapper.toWorkshop(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/workshops/{workshopId}")
  public Workshop updateWorkshop(
      @PathVariable String workshopId, @RequestBody WorkshopRequest request) {
    return workshopService.update(mapper.toWorkshop(request, workshopId));
  }

  @DeleteMapping("/api/workshops/{workshopId}")
  public ResponseEntity<Void> deleteWorkshop(@PathVariable String workshopId) {
    workshopService.delete(workshopId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/lines")
  public List<ProductionLine> listLines() {
    return lineService.findAll();
  }

  @GetMapping("/api/lines/{lineId}")
  public ProductionLine getLine(@PathVariable String lineId) {
    return lineService.get(lineId);
  }

  @PostMapping("/api/lines")
  public ResponseEntity<ProductionLine> createLine(@RequestBody ProductionLineRequest request) {
    ProductionLine created = lineService.create(mapper.toLine(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/api/lines/{lineId}")
  public ProductionLine updateLine(
      @PathVariable String lineId, @RequestBody ProductionLineRequest request) {
    return lineService.update(mapper.toLine(request, lineId));
  }

  @DeleteMapping("/api/lines/{lineId}")
  public ResponseEntity<Void> deleteLine(@PathVariable String lineId) {
    lineService.delete(lineId);
    return ResponseEntity.noContent().build();
  }
}
