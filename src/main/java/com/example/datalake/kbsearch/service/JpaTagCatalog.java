package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.dao.TagDefinitionRepository;
import com.example.datalake.kbsearch.entity.TagDefinitionEntity;
import com.example.datalake.kbsearch.model.TagDefinition;
import com.example.datalake.kbsearch.model.TagFieldType;
import com.example.datalake.kbsearch.model.TagSlot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTagCatalog implements TagCatalog {

    private final TagDefinitionRepository repository;

    @Override
    public List<TagDefinition> getTagDefinitions(String knowledgeBaseId) {
        List<TagDefinition> definitions = new ArrayList<>();
        for (TagDefinitionEntity entity : repository.findByKnowledgeBaseIdOrderByTagSlotAsc(knowledgeBaseId)) {
            Optional<TagSlot> slot = TagSlot.fromKey(entity.getTagSlot());
            if (slot.isEmpty()) {
                log.warn("Skipping tag definition {} of knowledge base {}: unknown slot '{}'",
                        entity.getId(), knowledgeBaseId, entity.getTagSlot());
                continue;
            }
            // the slot decides the stored type; a disagreeing field_type row is reported, not trusted
            TagFieldType declared = TagFieldType.fromWire(entity.getFieldType()).orElse(slot.get().fieldType());
            if (declared != slot.get().fieldType()) {
                log.warn("Tag definition {} declares {} for {} slot {}", entity.getId(),
                        declared.wireName(), slot.get().fieldType().wireName(), slot.get().key());
            }
            definitions.add(new TagDefinition(slot.get(), entity.getDisplayName(), slot.get().fieldType()));
        }
        return definitions;
    }
}
