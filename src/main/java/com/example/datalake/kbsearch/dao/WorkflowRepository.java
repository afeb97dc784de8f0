package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.entity.WorkflowEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkflowRepository extends JpaRepository<WorkflowEntity, String> {
}
