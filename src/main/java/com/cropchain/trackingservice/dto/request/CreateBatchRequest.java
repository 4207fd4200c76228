package com.cropchain.trackingservice.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Date;

@Data
public class CreateBatchRequest {

    @Size(min = 2, max = 100, message = "Farmer name must be between 2 and 100 characters.")
    private String farmerName; // Defaults to the caller's identity

    @Size(max = 500, message = "Farmer address cannot exceed 500 characters.")
    private String farmerAddress;

    @NotBlank(message = "Crop type is required.")
    private String cropType; // rice, wheat, corn or tomato

    @NotNull(message = "Quantity is required.")
    @Positive(message = "Quantity must be greater than 0.")
    @DecimalMax(value = "1000000", message = "Quantity cannot exceed 1,000,000.")
    private Double quantity;

    @NotNull(message = "Harvest date is required.")
    @PastOrPresent(message = "Harvest date cannot be in the future.")
    private Date harvestDate;

    @NotBlank(message = "Origin is required.")
    @Size(max = 200, message = "Origin cannot exceed 200 characters.")
    private String origin;

    @Size(max = 500)
    private String certifications;

    @Size(max = 1000)
    private String description;
}
