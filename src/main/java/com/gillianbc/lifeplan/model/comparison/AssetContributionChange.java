package com.gillianbc.lifeplan.model.comparison;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

@Getter
@EqualsAndHashCode(callSuper = false)
public class AssetContributionChange extends Change {

    private final String assetId;
    private final String assetName;
    private final BigDecimal oldContribution;
    private final BigDecimal newContribution;

    public AssetContributionChange(@NonNull String assetId, @NonNull String assetName,
                                   @NonNull BigDecimal oldContribution, @NonNull BigDecimal newContribution) {
        this.assetId = assetId;
        this.assetName = assetName;
        this.oldContribution = oldContribution;
        this.newContribution = newContribution;
    }

    @Override
    public ChangeKind getKind() {
        return ChangeKind.ASSET_CONTRIBUTION;
    }

    @Override
    public String describe() {
        return assetName + " contribution: " + dollars(oldContribution) + "/mo → " + dollars(newContribution) + "/mo";
    }
}
