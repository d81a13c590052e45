package com.pricewatch.tracker.harvest.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestCliRunnerTest {

    @Test
    void itemListIsSplitAndTrimmed() {
        assertThat(HarvestCliRunner.parseItems(" 101, 102 ,,103 ")).containsExactly("101", "102", "103");
        assertThat(HarvestCliRunner.parseItems("")).isEmpty();
        assertThat(HarvestCliRunner.parseItems(null)).isEmpty();
    }
}
