package com.pld.mft.controller;

import com.pld.mft.catalog.dto.PartBoxRequest;
import com.pld.mft.catalog.dto.PartBreakpointRequest;
import com.pld.mft.catalog.dto.PartLineRequest;
import com.pld.mft.catalog.dto.PartModelRequest;
import com.pld.mft.catalog.dto.PartRequest;
import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.PartToBox;
import com.pld.mft.catalog.entity.PartToBoxId;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.entity.PartToBreakpointId;
import com.pld.mft.catalog.entity.PartToLine;
import com.pld.mft.catalog.entity.PartToLineId;
import com.pld.mft.catalog.entity.PartToModel;
import com.pld.mft.catalog.entity.PartToModelId;
import com.pld.mft.catalog.mapper.CatalogRequestMapper;
import com.pld.mft.catalog.service.PartService;
import com.pld.mft.catalog.service.PartToBoxService;
import com.pld.mft.catalog.service.PartToBreakpointService;
import com.pld.mft.catalog.service.PartToLineService;
import com.pld.mft.catalog.service.PartToModelService;
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

/** Parts and the link tables keyed by part: boxes, models, lines and breakpoint snapshots. */
@RestController
@RequestMapping("/api/parts")
@RequiredArgsConstructor
public class PartController {

  private final PartService partService;
  private final PartToBoxService partToBoxService;
  private final PartToModelService partToModelService;
  private final PartToLineService partToLineService;
  private final PartToBreakpointService partToBreakpointService;
  private final CatalogRequestMapper mapper;

  @GetMapping
  public List<Part> list() {
    return partService.findAll();
  }

  @GetMapping("/{partId}")
  public Part get(@PathVariable String partId) {
    return partService.get(partId);
  }

  @PostMapping
  public ResponseEntity<Part> create(@RequestBody PartRequest request) {
    Part created = partService.create(mapper.toPart(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{partId}")
  public Part update(@PathVariable String partId, @RequestBody PartRequest request) {
    return partService.update(mapper.toPart(request, partId));
  }

  @DeleteMapping("/{partId}")
  public ResponseEntity<Void> delete(@PathVariable String partId) {
    partService.delete(partId);
    return ResponseEntity.noContent().build();
  }

  // ===== part_to_box =====

  @GetMapping("/{partId}/boxes")
  public List<PartToBox> listBoxes(@PathVariable String partId) {
    return partToBoxService.findByPart(partId);
  }

  @PostMapping("/{partId}/boxes")
  public ResponseEntity<PartToBox> addBox(
      @PathVariable String partId, @RequestBody PartBoxRequest request) {
    PartToBox created = partToBoxService.create(mapper.toPartToBox(partId, null, request));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{partId}/boxes/{boxId}")
  public PartToBox updateBox(
      @PathVariable String partId,
      @PathVariable String boxId,
      @RequestBody PartBoxRequest request) {
    return partToBoxService.update(mapper.toPartToBox(partId, boxId, request));
  }

  @DeleteMapping("/{partId}/boxes/{boxId}")
  public ResponseEntity<Void> removeBox(@PathVariable String partId, @PathVariable String boxId) {
    partToBoxService.delete(new PartToBoxId(partId, boxId));
    return ResponseEntity.noContent().build();
  }

  // ===== part_to_model =====

  @GetMapping("/{partId}/models")
  public List<PartToModel> listModels(@PathVariable String partId) {
    return partToModelService.findByPart(partId);
  }

  @PostMapping("/{partId}/models")
  public ResponseEntity<PartToModel> addModel(
      @PathVariable String partId, @RequestBody PartModelRequest request) {
    PartToModel created = partToModelService.create(mapper.toPartToModel(partId, null, request));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{partId}/models/{modelId}")
  public PartToModel updateModel(
      @PathVariable String partId,
      @PathVariable String modelId,
      @RequestBody PartModelRequest request) {
    return partToModelService.update(mapper.toPartToModel(partId, modelId, request));
  }

  @DeleteMapping("/{partId}/models/{modelId}")
  public ResponseEntity<Void> removeModel(
      @PathVariable String partId, @PathVariable String modelId) {
    partToModelService.delete(new PartToModelId(partId, modelId));
    return ResponseEntity.noContent().build();
  }

  // ===== part_to_line =====

  @GetMapping("/{partId}/lines")
  public List<PartToLine> listLines(@PathVariable String partId) {
    return partToLineService.findByPart(partId);
  }

  @PostMapping("/{partId}/lines")
  public ResponseEntity<PartToLine> addLine(
      @PathVariable String partId, @RequestBody PartLineRequest request) {
    PartToLine created =
        partToLineService.create(mapper.toPartToLine(partId, request.getLineId()));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @DeleteMapping("/{partId}/lines/{lineId}")
  public ResponseEntity<Void> removeLine(@PathVariable String partId, @PathVariable String lineId) {
    partToLineService.delete(new PartToLineId(partId, lineId));
    return ResponseEntity.noContent().build();
  }

  // ===== part_to_breakpoint =====

  @GetMapping("/{partId}/breakpoints")
  public List<PartToBreakpoint> listBreakpoints(@PathVariable String partId) {
    return partToBreakpointService.findByPart(partId);
  }

  @PostMapping("/{partId}/breakpoints")
  public ResponseEntity<PartToBreakpoint> addBreakpoint(
      @PathVariable String partId, @RequestBody PartBreakpointRequest request) {
    PartToBreakpoint created =
        partToBreakpointService.create(mapper.toPartToBreakpoint(partId, null, request));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{partId}/breakpoints/{breakpointId}")
  public PartToBreakpoint updateBreakpoint(
      @PathVariable String partId,
      @PathVariable String breakpointId,
      @RequestBody PartBreakpointRequest request) {
    return partToBreakpointService.update(
        mapper.toPartToBreakpoint(partId, breakpointId, request));
  }

  @DeleteMapping("/{partId}/breakpoints/{breakpointId}")
  public ResponseEntity<Void> removeBreakpoint(
      @PathVariable String partId, @PathVariable String breakpointId) {
    partToBreakpointService.delete(new PartToBreakpointId(partId, breakpointId));
    return ResponseEntity.noContent().build();
  }
}
