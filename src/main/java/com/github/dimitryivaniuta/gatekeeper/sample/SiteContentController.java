package com.github.dimitryivaniuta.gatekeeper.sample;

import com.github.dimitryivaniuta.gatekeeper.gate.GateContext;
import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;
import com.github.dimitryivaniuta.gatekeeper.identity.Principal;
import com.github.dimitryivaniuta.gatekeeper.permission.RequiresPermission;
import com.github.dimitryivaniuta.gatekeeper.sample.dto.CallerResponse;
import com.github.dimitryivaniuta.gatekeeper.sample.dto.ContentDraftRequest;
import com.github.dimitryivaniuta.gatekeeper.sample.dto.ContentItemResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Stand-in domain handlers showing what a gated handler receives. Content itself is not persisted.
 */
@Validated
@RestController
@RequestMapping("/api")
public class SiteContentController {

    @GetMapping("/me")
    public CallerResponse me(GateContext gate) {
        Principal p = gate.principal();
        return new CallerResponse(p.kind().tag(), p.id(), p.tenantScope().toString(),
                p.permissionLevel().name(), gate.rateLimitDegraded());
    }

    @RequiresPermission(PermissionLevel.READ)
    @GetMapping("/sites/{siteId}/content")
    public List<ContentItemResponse> list(@PathVariable UUID siteId, GateContext gate) {
        return List.of(new ContentItemResponse(itemId(siteId, "welcome"), siteId, "Welcome", gate.principal().id()));
    }

    @RequiresPermission(PermissionLevel.WRITE)
    @PostMapping("/sites/{siteId}/content")
    @ResponseStatus(HttpStatus.CREATED)
    public ContentItemResponse create(@PathVariable UUID siteId,
                                      @Valid @RequestBody ContentDraftRequest draft,
                                      GateContext gate) {
        return new ContentItemResponse(itemId(siteId, draft.title()), siteId, draft.title(), gate.principal().id());
    }

    @RequiresPermission(PermissionLevel.ADMIN)
    @DeleteMapping("/sites/{siteId}/content/{itemId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID siteId, @PathVariable UUID itemId) {
        // nothing stored
    }

    @RequiresPermission(value = PermissionLevel.MASTER, tenantScoped = false)
    @GetMapping("/admin/sites")
    public List<String> allSites() {
        return List.of("*");
    }

    private static UUID itemId(UUID siteId, String title) {
        return UUID.nameUUIDFromBytes((siteId + ":" + title).getBytes(StandardCharsets.UTF_8));
    }
}
