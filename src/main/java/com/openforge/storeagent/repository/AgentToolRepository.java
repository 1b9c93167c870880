package com.openforge.storeagent.repository;

import com.openforge.storeagent.domain.AgentTool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AgentToolRepository extends JpaRepository<AgentTool, Long> {

    Optional<AgentTool> findByToolName(String toolName);

    /** Active tools form the function list of every completion request. */
    List<AgentTool> findByIsActiveTrueOrderByToolNameAsc();
}
