package com.pld.mft.controller;

import com.pld.mft.catalog.service.CatalogStatisticsService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CatalogController {

  private final CatalogStatisticsService statisticsService;

  @GetMapping("/api/catalog/stats")
  public Map<String, Long> stats() {
    return statisticsService.counts();
  }
}
