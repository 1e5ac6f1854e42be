package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeStyle {

    private String color;
    private Integer width;
    private String lineStyle;   // solid for direct edges, dashed for indirect ones
    private String arrowShape;
}
