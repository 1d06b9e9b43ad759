package com.phillippitts.liveagent.service.health;

import com.phillippitts.liveagent.service.avatar.AvatarState;
import com.phillippitts.liveagent.service.session.CallSession;
import com.phillippitts.liveagent.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of avatar rendering across live sessions.
 *
 * <ul>
 *   <li>UP: no avatar session has degraded (or there are none)</li>
 *   <li>DEGRADED: some avatar sessions fell back to audio-only</li>
 *   <li>DOWN: every avatar session fell back to audio-only</li>
 * </ul>
 *
 * <p>Calls keep running in every case; DOWN points at the rendering service, not at this process.
 * Exposed via /actuator/health.
 */
@Component
public class AvatarHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;

    public AvatarHealthIndicator(SessionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        int active = 0;
        int degraded = 0;
        for (CallSession session : registry.all()) {
            AvatarState state = session.avatarState().orElse(null);
            if (state == AvatarState.ACTIVE) {
                active++;
            } else if (state == AvatarState.DEGRADED) {
                degraded++;
            }
        }

        Health.Builder builder = new Health.Builder();
        if (degraded == 0) {
            builder.up();
        } else if (active > 0) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder
                .withDetail("sessions", registry.size())
                .withDetail("avatarActive", active)
                .withDetail("avatarDegraded", degraded)
                .build();
    }
}
