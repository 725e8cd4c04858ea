package ru.oparin.studiocrm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.model.dto.PortalStudioDTO;
import ru.oparin.studiocrm.model.enums.Role;
import ru.oparin.studiocrm.service.PhotographerService;
import ru.oparin.studiocrm.util.SecurityUtil;

@RestController
@RequestMapping("/portal")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Портал клиента", description = "API портала клиента студии")
public class ClientPortalController {

    private final PhotographerService photographerService;

    @Operation(summary = "Студия клиента",
            description = "Студия из сессии клиента. Требуется роль CLIENT")
    @GetMapping("/studio")
    public Mono<ResponseEntity<PortalStudioDTO>> getStudio() {
        return SecurityUtil.requireRole(Role.CLIENT)
                .flatMap(photographerService::getPortalStudio)
                .map(ResponseEntity::ok);
    }
}
