package com.axiomprofiler.dto.session;

import com.axiomprofiler.service.disable.Disabler;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisablersRequest {

    @NotNull(message = "Disabler set is required, use an empty set to disable none")
    private Set<Disabler> disablers;
}
