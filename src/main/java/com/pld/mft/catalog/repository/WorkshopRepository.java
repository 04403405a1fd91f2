package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.domain.WorkshopCode;
import com.pld.mft.catalog.entity.Workshop;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkshopRepository extends JpaRepository<Workshop, String> {

  Optional<Workshop> findFirstByWorkshopCode(WorkshopCode workshopCode);
}
