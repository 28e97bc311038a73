package com.roster.controller.rest;

import com.roster.player.model.PlayerView;
import com.roster.service.core.spi.PlayerIngestService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/server/api")
public class PlayerController {
    private final PlayerIngestService ingest;
    private final ClientOriginResolver originResolver;

    public PlayerController(PlayerIngestService ingest, ClientOriginResolver originResolver) {
        this.ingest = ingest;
        this.originResolver = originResolver;
    }

    @PostMapping(value = "/player", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> submit(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        ingest.submit(body, originResolver.resolve(request));
        return Map.of("success", true);
    }

    /** Form-encoded reports; a key sent more than once keeps its first value. */
    @PostMapping(value = "/player", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Map<String, Object> submitForm(
            @RequestParam MultiValueMap<String, String> form, HttpServletRequest request) {
        ingest.submit(form.toSingleValueMap(), originResolver.resolve(request));
        return Map.of("success", true);
    }

    @GetMapping("/players")
    public List<PlayerView> list() {
        return ingest.list();
    }
}
