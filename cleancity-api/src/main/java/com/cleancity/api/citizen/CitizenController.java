package com.cleancity.api.citizen;

import com.cleancity.api.citizen.CitizenStatsService.CitizenStats;
import com.cleancity.api.citizen.CitizenStatsService.LeaderboardEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/citizens")
public class CitizenController {

    private final CitizenStatsService citizenStatsService;

    public CitizenController(CitizenStatsService citizenStatsService) {
        this.citizenStatsService = citizenStatsService;
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<LeaderboardEntry>> leaderboard(
            @RequestParam(required = false) String area,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(citizenStatsService.leaderboard(area, limit));
    }

    @GetMapping("/{deviceId}/stats")
    public ResponseEntity<CitizenStats> stats(@PathVariable String deviceId) {
        return ResponseEntity.ok(citizenStatsService.getStats(deviceId));
    }
}
