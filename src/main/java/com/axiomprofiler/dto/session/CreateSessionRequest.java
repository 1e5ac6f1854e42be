package com.axiomprofiler.dto.session;

import com.axiomprofiler.model.facts.InMemoryFactStore;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotNull(message = "Fact store is required")
    private InMemoryFactStore facts;
}
