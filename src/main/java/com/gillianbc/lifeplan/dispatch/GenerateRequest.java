package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.model.Profile;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class GenerateRequest extends ProjectionRequest {

    private final Profile profile;

    public GenerateRequest(@NonNull Profile profile) {
        this.profile = profile;
    }
}
