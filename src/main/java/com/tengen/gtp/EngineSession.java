package com.tengen.gtp;

import com.tengen.core.model.GoGame;
import com.tengen.core.model.GoGameType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Engine housekeeping around a game: pondering and the computer player's profile.
 * <p>
 * Pondering commands are sent asynchronously. Because the channel is ordered, any
 * blocking command submitted afterwards only runs once the engine has stopped thinking.
 */
@Service
public class EngineSession {

    private static final Logger log = LoggerFactory.getLogger(EngineSession.class);

    private final GtpClient client;
    private final EngineProperties properties;

    public EngineSession(GtpClient client, EngineProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public void stopPondering() {
        client.submit(GtpCommand.async("uct_param_player ponder 0", this::logIfRejected));
    }

    public void startPondering() {
        client.submit(GtpCommand.async("uct_param_player ponder 1", this::logIfRejected));
    }

    /**
     * Turns pondering back on if the profile active for {@code game} wants it.
     */
    public void restorePondering(GoGame game) {
        if (activeProfile(game).pondering() && client.isEngineAvailable()) {
            startPondering();
        }
    }

    /**
     * Installs the profile for the computer player of {@code game}.
     *
     * @return the profile that was applied, or {@code null} if profile setup is disabled
     * @throws EngineStateException if the engine rejects a profile command
     */
    public EngineProfile setupComputerPlayer(GoGame game) {
        if (!properties.isApplyProfile()) {
            log.debug("Engine profile setup is disabled");
            return null;
        }
        EngineProfile profile = activeProfile(game);
        for (String command : profile.gtpCommands()) {
            client.submitChecked(command);
        }
        log.info("Applied engine profile for {} game {}", game.type(), game.id());
        return profile;
    }

    /**
     * Human vs human games have no computer player and use the fallback profile.
     */
    public EngineProfile activeProfile(GoGame game) {
        if (game.type() == GoGameType.HUMAN_VS_HUMAN) {
            return properties.getHumanVsHumanProfile().toEngineProfile();
        }
        return properties.getProfile().toEngineProfile();
    }

    private void logIfRejected(GtpResponse response) {
        if (!response.success()) {
            log.debug("Engine rejected '{}': {}", response.command(), response.payload());
        }
    }
}
