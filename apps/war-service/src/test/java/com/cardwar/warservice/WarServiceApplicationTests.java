package com.cardwar.warservice;

import com.cardwar.warservice.config.WarProperties;
import com.cardwar.warservice.games.war.codec.CodecFormat;
import com.cardwar.warservice.games.war.domain.model.MoveIntent;
import com.cardwar.warservice.games.war.domain.rule.WarPolicy;
import com.cardwar.warservice.games.war.guard.InvariantChecker;
import com.cardwar.warservice.games.war.service.MoveResult;
import com.cardwar.warservice.games.war.service.MoveStatus;
import com.cardwar.warservice.games.war.service.WarGameService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class WarServiceApplicationTests {

    @Autowired
    private WarGameService warGameService;

    @Autowired
    private WarProperties warProperties;

    @Autowired
    private InvariantChecker invariantChecker;

    @Test
    void contextShouldBindDefaultsAndPlayAMove() {
        assertEquals(WarPolicy.IMMEDIATE, warProperties.getRules().getWarPolicy());
        assertFalse(warProperties.getRules().isIncludeSpecialCards());
        assertEquals(Duration.ofMillis(1000), warProperties.getCooldown());
        assertEquals(CodecFormat.FULL, warProperties.getCodec().getFormat());
        assertTrue(invariantChecker.strict());

        MoveResult fresh = warGameService.newGame(null);
        assertEquals(52, fresh.state().totalCards());

        MoveResult first = warGameService.play(fresh.token(), MoveIntent.draw());
        assertEquals(MoveStatus.ACCEPTED, first.status());
        assertEquals(1, first.state().moveCount());
    }
}
