package com.crosspost.platform.connector.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAttachment {
    private String type; // image, video
    private String url;
    private String alt;
    private String filename;
}
