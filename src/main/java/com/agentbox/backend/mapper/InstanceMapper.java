package com.agentbox.backend.mapper;

import com.agentbox.backend.dto.response.InstanceAccessResponse;
import com.agentbox.backend.dto.response.InstanceResponse;
import com.agentbox.backend.entity.Instance;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface InstanceMapper {

    @Mapping(target = "hostname", ignore = true)
    InstanceResponse toInstanceResponse(Instance entity);

    @Mapping(target = "hostname", ignore = true)
    @Mapping(target = "ssh", ignore = true)
    @Mapping(target = "chatUrl", ignore = true)
    @Mapping(target = "terminalUrl", ignore = true)
    InstanceAccessResponse toInstanceAccessResponse(Instance entity);
}
