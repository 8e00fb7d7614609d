package com.goldtrader.exception;

import java.util.Map;
import lombok.Getter;

/** An account or transaction lookup that matched nothing. */
@Getter
public class ResourceNotFoundException extends BaseException {

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " does not exist",
                Map.of("resource", resourceType, "id", identifier));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }
}
