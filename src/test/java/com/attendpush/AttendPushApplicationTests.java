package com.attendpush;

import com.attendpush.infrastructure.device.DeviceGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AttendPushApplicationTests {

    @Autowired
    private DeviceGateway deviceGateway;

    @Test
    void contextLoads() {
        assertThat(deviceGateway.getStatuses()).isEmpty();
    }
}
