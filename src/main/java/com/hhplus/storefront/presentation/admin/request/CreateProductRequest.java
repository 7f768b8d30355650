package com.hhplus.storefront.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProductRequest {
    private String name;

    private Long price;

    private String description;

    @JsonProperty("photo_reference")
    private String photoReference;
}
