package net.homeroute.controller;

import net.homeroute.adapters.persistence.RegistryDocumentCodec;
import net.homeroute.controller.support.ResponseBodies;
import net.homeroute.domain.registry.Host;
import net.homeroute.dto.HostDraft;
import net.homeroute.dto.ToggleRequest;
import net.homeroute.service.HostService;
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
@RequestMapping("/api/reverseproxy/hosts")
public class HostController {

    private final HostService hostService;
    private final RegistryDocumentCodec codec;

    public HostController(HostService hostService, RegistryDocumentCodec codec) {
        this.hostService = hostService;
        this.codec = codec;
    }

    @GetMapping
    public Map<String, Object> list() {
        return ResponseBodies.success("hosts", hostService.list().stream().map(codec::toTree).toList());
    }

    @PostMapping
    public Map<String, Object> create(@RequestBody HostDraft draft) {
        return respond(hostService.create(draft));
    }

    @PutMapping("/{id}")
    public Map<String, Object> update(@PathVariable String id, @RequestBody HostDraft draft) {
        return respond(hostService.update(id, draft));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        return respond(hostService.delete(id));
    }

    @PostMapping("/{id}/toggle")
    public Map<String, Object> toggle(@PathVariable String id, @RequestBody ToggleRequest request) {
        return respond(hostService.toggle(id, Boolean.TRUE.equals(request.enabled())));
    }

    private Map<String, Object> respond(MutationResult<Host> result) {
        return ResponseBodies.mutation("host", codec.toTree(result.value()), result.sync());
    }
}
