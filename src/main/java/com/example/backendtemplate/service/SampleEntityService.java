package com.example.backendtemplate.service;

import com.example.backendtemplate.domain.repository.OffsetPageRequest;
import com.example.backendtemplate.domain.repository.SampleEntityRepository;
import com.example.backendtemplate.dto.CreateSampleRequest;
import com.example.backendtemplate.dto.SampleListResponse;
import com.example.backendtemplate.dto.SampleResponse;
import com.example.backendtemplate.dto.UpdateSampleRequest;
import com.example.backendtemplate.exception.SampleEntityNotFoundException;
import com.example.backendtemplate.mapper.SampleMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for sample entities.
 * <p>
 * Reads and updates only see rows that are active and not deleted; listing can
 * optionally include the others. Deletes are soft unless a hard delete is requested.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SampleEntityService {

    private final SampleEntityRepository repository;
    private final SampleMapper mapper;

    @Transactional
    public SampleResponse create(CreateSampleRequest request) {
        var entity = mapper.toEntity(request);
        if (entity.getBigInt() == null) {
            entity.setBigInt(1L);
        }
        if (entity.getRequiredJsonb() == null) {
            entity.setRequiredJsonb(new HashMap<>());
        }

        entity = repository.save(entity);
        log.info("Created sample entity with ID: {}", entity.getId());
        return mapper.toResponse(entity);
    }

    /**
     * @throws SampleEntityNotFoundException if no active, non-deleted entity has this id
     */
    @Transactional(readOnly = true)
    public SampleResponse getById(UUID id) {
        var entity = repository.findByIdAndActiveTrueAndDeletedFalse(id)
                .orElseThrow(() -> {
                    log.warn("Sample entity not found with ID: {}", id);
                    return new SampleEntityNotFoundException(id);
                });
        return mapper.toResponse(entity);
    }

    @Transactional(readOnly = true)
    public SampleListResponse list(long skip, int limit, boolean includeInactive) {
        var page = OffsetPageRequest.newestFirst(skip, limit);

        var entities = includeInactive
                ? repository.findAll(page).getContent()
                : repository.findByActiveTrueAndDeletedFalse(page);
        var total = includeInactive ? repository.count() : repository.countByActiveTrueAndDeletedFalse();

        log.info("Retrieved {} sample entities (skip={}, limit={}, total={})", entities.size(), skip, limit, total);

        return SampleListResponse.builder()
                .items(mapper.toResponseList(entities))
                .total(total)
                .skip(skip)
                .limit(limit)
                .build();
    }

    /**
     * Case-insensitive substring search on the string field
     */
    @Transactional(readOnly = true)
    public List<SampleResponse> searchByStringField(String term, long skip, int limit) {
        var entities = repository.searchByStringField(term, OffsetPageRequest.newestFirst(skip, limit));
        log.info("Search for '{}' returned {} results", term, entities.size());
        return mapper.toResponseList(entities);
    }

    /**
     * Apply the non-null fields of the request.
     *
     * @throws IllegalArgumentException      if the request carries no field at all
     * @throws SampleEntityNotFoundException if no active, non-deleted entity has this id
     */
    @Transactional
    public SampleResponse update(UUID id, UpdateSampleRequest request) {
        if (request == null || request.isEmpty()) {
            throw new IllegalArgumentException("No fields provided for update");
        }

        var entity = repository.findByIdAndActiveTrueAndDeletedFalse(id)
                .orElseThrow(() -> new SampleEntityNotFoundException(id));

        mapper.updateEntity(request, entity);
        entity = repository.saveAndFlush(entity);

        log.info("Updated sample entity with ID: {}", id);
        return mapper.toResponse(entity);
    }

    /**
     * @param hardDelete remove the row instead of flagging it deleted
     * @throws SampleEntityNotFoundException if no active, non-deleted entity has this id
     */
    @Transactional
    public void delete(UUID id, boolean hardDelete) {
        var entity = repository.findByIdAndActiveTrueAndDeletedFalse(id)
                .orElseThrow(() -> new SampleEntityNotFoundException(id));

        if (hardDelete) {
            repository.delete(entity);
            log.info("Hard deleted sample entity with ID: {}", id);
        } else {
            entity.softDelete();
            repository.save(entity);
            log.info("Soft deleted sample entity with ID: {}", id);
        }
    }
}
