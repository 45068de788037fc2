package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.model.Profile;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A truncated projection; {@code years} null means the configured preview length.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class GenerateQuickRequest extends ProjectionRequest {

    private final Profile profile;
    private final Integer years;

    public GenerateQuickRequest(@NonNull Profile profile, Integer years) {
        this.profile = profile;
        this.years = years;
    }

    public GenerateQuickRequest(Profile profile) {
        this(profile, null);
    }
}
