package com.punchwheel.config;

import com.punchwheel.model.enums.NotificationLevel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PunchNotifierPropertiesTest {

    @Test
    void everyLevelIsOnByDefault() {
        PunchNotifierProperties.Provider cfg = new PunchNotifierProperties.Provider();

        for (NotificationLevel level : NotificationLevel.values()) {
            assertThat(cfg.notifies(level)).as(level.name()).isTrue();
        }
    }

    @Test
    void eachSwitchMutesItsOwnLevel() {
        PunchNotifierProperties.Provider cfg = new PunchNotifierProperties.Provider();
        cfg.setNotifyScheduler(false);
        cfg.setNotifyErrors(false);

        assertThat(cfg.notifies(NotificationLevel.INFO)).isFalse();
        assertThat(cfg.notifies(NotificationLevel.WARNING)).isFalse();
        assertThat(cfg.notifies(NotificationLevel.SUCCESS)).isTrue();
        assertThat(cfg.notifies(NotificationLevel.ERROR)).isTrue();
        assertThat(cfg.filterReason(NotificationLevel.INFO)).isEqualTo("level INFO switched off");
    }

    @Test
    void minLevelIsCheckedBeforeSwitches() {
        PunchNotifierProperties.Provider cfg = new PunchNotifierProperties.Provider();
        cfg.setMinLevel(NotificationLevel.ERROR);
        cfg.setNotifyFailure(false);

        assertThat(cfg.notifies(NotificationLevel.SUCCESS)).isFalse();
        assertThat(cfg.notifies(NotificationLevel.ERROR)).isFalse();
        assertThat(cfg.filterReason(NotificationLevel.SUCCESS)).isEqualTo("level SUCCESS below ERROR");
    }
}
