package com.flagship.equipment_booking.kit;

import com.flagship.equipment_booking.kit.dto.CreateKitRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/kits")
@RequiredArgsConstructor
public class KitController {

    private final KitService kitService;
    private final KitAvailabilityResolver kitAvailabilityResolver;

    @PostMapping
    public ResponseEntity<Kit> createKit(@Valid @RequestBody CreateKitRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(kitService.createKit(request.toKit()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Kit> getKit(@PathVariable("id") String id) {
        return ResponseEntity.ok(kitService.getKit(id));
    }

    @GetMapping
    public ResponseEntity<List<Kit>> listKits() {
        return ResponseEntity.ok(kitService.listKits());
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<KitAvailabilityResult> isKitAvailable(
            @PathVariable("id") String id,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return ResponseEntity.ok(kitAvailabilityResolver.isKitAvailable(id, start, end));
    }
}
