package com.cropchain.trackingservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Date;

/**
 * One supply-chain step reported against an existing batch.
 */
@Data
public class UpdateBatchRequest {

    @NotBlank(message = "Stage is required.")
    private String stage; // Case-insensitive: farmer, mandi, transport or retailer

    @NotBlank(message = "Actor is required.")
    @Size(min = 2, max = 100)
    private String actor;

    @NotBlank(message = "Location is required.")
    @Size(min = 2, max = 200)
    private String location;

    @PastOrPresent(message = "Timestamp cannot be in the future.")
    private Date timestamp; // Defaults to now

    @Size(max = 500, message = "Notes cannot exceed 500 characters.")
    private String notes;
}
