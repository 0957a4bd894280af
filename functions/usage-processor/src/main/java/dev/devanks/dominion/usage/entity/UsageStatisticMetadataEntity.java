package dev.devanks.dominion.usage.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "usage_statistic_metadata")
public class UsageStatisticMetadataEntity {
    @DocumentId
    private String id; // the statistic id
    private String name;
    private String source;
    private String unitOfMeasurement;
    private boolean hasSum;
    private boolean hasMean;
}
