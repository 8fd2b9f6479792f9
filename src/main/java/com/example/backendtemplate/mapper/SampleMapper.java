package com.example.backendtemplate.mapper;

import com.example.backendtemplate.domain.entity.SampleEntity;
import com.example.backendtemplate.dto.CreateSampleRequest;
import com.example.backendtemplate.dto.SampleResponse;
import com.example.backendtemplate.dto.UpdateSampleRequest;
import org.mapstruct.BeanMapping;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper between sample entities and their DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE, builder = @Builder(disableBuilder = true))
public interface SampleMapper {

    SampleEntity toEntity(CreateSampleRequest request);

    SampleResponse toResponse(SampleEntity entity);

    List<SampleResponse> toResponseList(List<SampleEntity> entities);

    /**
     * Copy the non-null fields of an update request onto an entity
     */
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    void updateEntity(UpdateSampleRequest request, @MappingTarget SampleEntity entity);
}
