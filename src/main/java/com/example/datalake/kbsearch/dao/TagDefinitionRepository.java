package com.example.datalake.kbsearch.dao;

import com.example.datalake.kbsearch.entity.TagDefinitionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TagDefinitionRepository extends JpaRepository<TagDefinitionEntity, String> {

    List<TagDefinitionEntity> findByKnowledgeBaseIdOrderByTagSlotAsc(String knowledgeBaseId);
}
