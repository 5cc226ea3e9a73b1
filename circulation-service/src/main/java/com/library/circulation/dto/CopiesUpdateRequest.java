package com.library.circulation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record CopiesUpdateRequest(
    @NotNull @Min(0) Integer totalCopies
) {}
