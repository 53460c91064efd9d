package com.crosspost.platform.scheduler.dto;

import com.crosspost.platform.connector.model.MediaItem;
import lombok.*;

import java.util.List;

/**
 * Content edit of one variant. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditContentRequest {
    private String text;
    private List<MediaItem> media;
}
