package com.pharmafinder.matcher;

import com.pharmafinder.matcher.model.MatchMethod;
import com.pharmafinder.matcher.service.CommuneMatcherService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "aws.region=us-east-1"
})
class CommuneMatcherApplicationTests {

    @Autowired
    private CommuneMatcherService matcherService;

    @Test
    void contextLoads() {
        assertThat(matcherService.currentGeneration()).isEqualTo(1);
        assertThat(matcherService.match("farmacias en la florida").method()).isEqualTo(MatchMethod.NL_EXTRACTED);
    }
}
