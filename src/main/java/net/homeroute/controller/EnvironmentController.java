package net.homeroute.controller;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.controller.support.ResponseBodies;
import net.homeroute.domain.registry.Environment;
import net.homeroute.dto.EnvironmentDraft;
import net.homeroute.service.EnvironmentService;
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
@RequestMapping("/api/reverseproxy/environments")
public class EnvironmentController {

    private final EnvironmentService environmentService;
    private final RegistryDocumentCodec codec;

    public EnvironmentController(EnvironmentService environmentService, RegistryDocumentCodec codec) {
        this.environmentService = environmentService;
        this.codec = codec;
    }

    @GetMapping
    public Map<String, Object> list() {
        return ResponseBodies.success("environments",
            environmentService.list().stream().map(codec::toTree).toList());
    }

    @PostMapping
    public Map<String, Object> create(@RequestBody EnvironmentDraft draft) {
        return respond(environmentService.create(draft));
    }

    @PutMapping("/{id}")
    public Map<String, Object> update(@PathVariable String id, @RequestBody EnvironmentDraft draft) {
        return respond(environmentService.update(id, draft));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        return respond(environmentService.delete(id));
    }

    private Map<String, Object> respond(MutationResult<Environment> result) {
        return ResponseBodies.mutation("environment", codec.toTree(result.value()), result.sync());
    }
}
