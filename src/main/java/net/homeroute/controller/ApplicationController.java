package net.homeroute.controller;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.controller.support.ResponseBodies;
import net.homeroute.domain.registry.Application;
import net.homeroute.dto.ApplicationDraft;
import net.homeroute.dto.ToggleRequest;
import net.homeroute.service.ApplicationService;
import net.homeroute.service.MutationResult;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/reverseproxy/applications")
public class ApplicationController {

    private final ApplicationService applicationService;
    private final RegistryDocumentCodec codec;

    public ApplicationController(ApplicationService applicationService, RegistryDocumentCodec codec) {
        this.applicationService = applicationService;
        this.codec = codec;
    }

    @GetMapping
    public Map<String, Object> list() {
        return ResponseBodies.success("applications",
            applicationService.list().stream().map(codec::toTree).toList());
    }

    @PostMapping
    public Map<String, Object> create(@RequestBody ApplicationDraft draft) {
        return respond(applicationService.create(draft));
    }

    @PutMapping("/{id}")
    public Map<String, Object> update(@PathVariable String id, @RequestBody ApplicationDraft draft) {
        return respond(applicationService.update(id, draft));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        return respond(applicationService.delete(id));
    }

    @PostMapping("/{id}/toggle")
    public Map<String, Object> toggle(@PathVariable String id, @RequestBody ToggleRequest request) {
        return respond(applicationService.toggle(id, Boolean.TRUE.equals(request.enabled())));
    }

    private Map<String, Object> respond(MutationResult<Application> result) {
        return ResponseBodies.mutation("application", codec.toTree(result.value()), result.sync());
    }
}
