package io.github.vishalmysore.legalnet.export;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Context written into export headers. Every field is optional.
 */
@Value
@Builder
public class ExportMetadata {
    String timeScope;
    String title;
    @Singular
    List<String> filterTypes;
    String searchTerm;

    public static ExportMetadata none() {
        return ExportMetadata.builder().build();
    }
}
