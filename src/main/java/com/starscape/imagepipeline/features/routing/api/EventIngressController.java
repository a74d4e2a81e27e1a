package com.starscape.imagepipeline.features.routing.api;

import com.starscape.imagepipeline.features.routing.api.dto.IngressResponse;
import com.starscape.imagepipeline.features.routing.app.EventIngress;
import com.starscape.imagepipeline.features.routing.app.IngressResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP push endpoint for pub/sub envelopes.
 * Publishers use it for object-store notifications and for attribute messages such as
 * description updates ({@code comment_type=Description}).
 */
@RestController
@RequestMapping("/events")
public class EventIngressController {

    private final EventIngress ingress;

    public EventIngressController(EventIngress ingress) {
        this.ingress = ingress;
    }

    /**
     * Accept one raw envelope.
     * POST /events
     */
    @PostMapping(consumes = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<IngressResponse> publish(@RequestBody String envelope) {
        IngressResult result = ingress.accept(envelope);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngressResponse.from(result));
    }
}
