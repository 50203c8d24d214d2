package com.di.qualityguard.table;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * CSV loader settings.
 *
 * <pre>
 * qualityguard:
 *   loader:
 *     missing-markers: ",NA,N/A,null"
 *     max-rows: 0
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "qualityguard.loader")
public class TableLoaderProperties {

    /**
     * Comma-separated cell values (compared after trimming) that mean "no value".
     * A blank cell is always missing, whatever this list says.
     */
    private String missingMarkers = "NA,N/A,n/a,NaN,nan,-NaN,null,NULL,None,#N/A,<NA>";

    /** Upper bound on data rows per upload. 0 = unlimited. */
    private int maxRows = 0;

    /** Parses {@link #missingMarkers} into a trimmed, non-empty list. */
    public List<String> getMissingMarkersList() {
        if (missingMarkers == null || missingMarkers.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String m : missingMarkers.split(",")) {
            String trimmed = m.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }
}
