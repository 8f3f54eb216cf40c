package com.movesim.mapper;

import com.movesim.api.dto.response.LocationPointResponse;
import com.movesim.api.dto.response.SessionStatusResponse;
import com.movesim.domain.model.Sample;
import com.movesim.domain.model.SessionSummary;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for simulation domain models to response DTOs.
 */
@Mapper
public interface LocationMapper {

    @Mapping(target = "dx", source = "deltaX")
    @Mapping(target = "dy", source = "deltaY")
    @Mapping(target = "ts", source = "timestamp")
    LocationPointResponse toResponse(Sample sample);

    List<LocationPointResponse> toResponseList(List<Sample> samples);

    @Mapping(target = "userIds", source = "entityIds")
    SessionStatusResponse toResponse(SessionSummary sessionSummary);
}
