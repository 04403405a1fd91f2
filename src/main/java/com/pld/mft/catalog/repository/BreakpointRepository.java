package com.pld.mft.catalog.repository;

import com.pld.mft.catalog.entity.Breakpoint;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BreakpointRepository extends JpaRepository<Breakpoint, String> {

  Optional<Breakpoint> findFirstByBreakpointNumberOrderByInputDateDesc(String breakpointNumber);
}
