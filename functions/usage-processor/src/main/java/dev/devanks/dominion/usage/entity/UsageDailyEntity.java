package dev.devanks.dominion.usage.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.*;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "usage_daily")
public class UsageDailyEntity {
    @DocumentId
    @NonNull
    private String id;
    private String accountId;
    private String date; // yyyy-MM-dd in the account's timezone
    private double totalEnergyKWh;
    private double averagePowerKW;
    private double peakPowerKW;
    private Instant peakPowerTimestamp;
    private int dataPoints;
}
