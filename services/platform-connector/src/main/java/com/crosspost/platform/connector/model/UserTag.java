package com.crosspost.platform.connector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Account tagged on an image, positioned relative to its top-left corner (0..1 on both axes).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserTag {
    private String username;
    private double x;
    private double y;
}
