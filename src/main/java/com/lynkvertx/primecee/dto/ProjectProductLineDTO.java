package com.lynkvertx.primecee.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One product line of a project
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectProductLineDTO {

    private Long id;

    private Long productId;

    /** Number or numeric string; anything unparseable counts as absent */
    private Object quantity;

    /** Schema-described attributes entered by the user */
    private Map<String, Object> dynamicParams;
}
