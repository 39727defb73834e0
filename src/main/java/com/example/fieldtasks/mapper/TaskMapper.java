package com.example.fieldtasks.mapper;

import com.example.fieldtasks.domain.entity.FieldTask;
import com.example.fieldtasks.dto.TaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting tasks to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    TaskResponse toResponse(FieldTask task);

    List<TaskResponse> toResponseList(List<FieldTask> tasks);
}
