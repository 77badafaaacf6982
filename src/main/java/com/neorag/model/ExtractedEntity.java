package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Named entity found in a piece of text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedEntity {

    private String name;

    /**
     * PERSON, LOCATION, ORGANIZATION, DATE or CONCEPT.
     */
    private String type;

    private String description;
}
