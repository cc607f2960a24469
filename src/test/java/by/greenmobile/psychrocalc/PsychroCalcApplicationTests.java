package by.greenmobile.psychrocalc;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PsychroCalcApplicationTests {

    @Test
    void contextLoads() {
    }
}
