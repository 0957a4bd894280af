package dev.devanks.dominion.usage.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "usage_statistics")
public class UsageStatisticEntity {

    // <statisticId>@<epochSecond>, so saving a point for an existing hour overwrites it
    @DocumentId
    private String id;

    private String statisticId;
    private Instant start;
    private double state;
    private double sum;

    public static String documentIdFor(String statisticId, Instant start) {
        return statisticId + "@" + start.getEpochSecond();
    }
}
