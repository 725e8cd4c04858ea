package ru.oparin.studiocrm.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Сведения о студии, видимые ее клиенту в портале.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PortalStudioDTO {

    private String photographerId;
    private String businessName;
}
