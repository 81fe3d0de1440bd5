package com.z254.gridpulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A dated external record (news article, notice) about a region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextRecord {

    private String title;

    private String summary;

    private String url;

    private String source;

    private LocalDate publishedDate;
}
