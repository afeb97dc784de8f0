package com.example.datalake.kbsearch.service;

import com.example.datalake.kbsearch.dao.DocumentRepository;
import com.example.datalake.kbsearch.entity.DocumentEntity;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JpaDocumentNameResolver implements DocumentNameResolver {

    private final DocumentRepository repository;

    @Override
    public Map<String, String> getNames(Collection<String> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return Map.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        documentIds.stream().filter(Objects::nonNull).forEach(unique::add);
        if (unique.isEmpty()) {
            return Map.of();
        }

        Map<String, String> names = new HashMap<>();
        for (DocumentEntity document : repository.findByIdInAndDeletedAtIsNull(unique)) {
            names.put(document.getId(), document.getFilename());
        }
        return names;
    }
}
