package com.pld.mft.controller;

import com.pld.mft.catalog.dto.BreakpointRequest;
import com.pld.mft.catalog.dto.SnapshotCaptureRequest;
import com.pld.mft.catalog.entity.Breakpoint;
import com.pld.mft.catalog.entity.PartToBreakpoint;
import com.pld.mft.catalog.mapper.CatalogRequestMapper;
import com.pld.mft.catalog.service.BreakpointService;
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
@RequestMapping("/api/breakpoints")
@RequiredArgsConstructor
public class BreakpointController {

  private final BreakpointService breakpointService;
  private final CatalogRequestMapper mapper;

  @GetMapping
  public List<Breakpoint> list() {
    return breakpointService.findAll();
  }

  @GetMapping("/{breakpointId}")
  public Breakpoint get(@PathVariable String breakpointId) {
    return breakpointService.get(breakpointId);
  }

  @PostMapping
  public ResponseEntity<Breakpoint> create(@RequestBody BreakpointRequest request) {
    Breakpoint created = breakpointService.create(mapper.toBreakpoint(request, null));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @PutMapping("/{breakpointId}")
  public Breakpoint update(
      @PathVariable String breakpointId, @RequestBody BreakpointRequest request) {
    return breakpointService.update(mapper.toBreakpoint(request, breakpointId));
  }

  @DeleteMapping("/{breakpointId}")
  public ResponseEntity<Void> delete(@PathVariable String breakpointId) {
    breakpointService.delete(breakpointId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{breakpointId}/capture")
  public ResponseEntity<PartToBreakpoint> capture(
      @PathVariable String breakpointId, @RequestBody SnapshotCaptureRequest request) {
    if (request.getPartId() == null || request.getPartId().isBlank()) {
      throw new IllegalArgumentException("partId is required");
    }
    String lineId =
        request.getLineId() == null || request.getLineId().isBlank()
            ? null
            : request.getLineId().trim();
    PartToBreakpoint snapshot =
        breakpointService.capture(breakpointId, request.getPartId().trim(), lineId);
    return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
  }
}
