package pgs.runtime.vm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * VmOptions 测试
 */
class VmOptionsTest {

    @Test
    @DisplayName("默认限制")
    void defaults() {
        VmOptions options = VmOptions.defaults();
        assertThat(options.getMaxFrames()).isEqualTo(1024);
        assertThat(options.getMaxStackSize()).isEqualTo(65536);
        assertThat(options.getInstructionBudget()).isZero();
        assertThat(options.hasInstructionBudget()).isFalse();
        assertThat(options.getCheckInterval()).isEqualTo(1024);
    }

    @Test
    @DisplayName("Builder 覆盖部分字段")
    void custom() {
        VmOptions options = VmOptions.custom()
                .maxFrames(32)
                .instructionBudget(10_000)
                .build();
        assertThat(options.getMaxFrames()).isEqualTo(32);
        assertThat(options.getMaxStackSize()).isEqualTo(65536);
        assertThat(options.hasInstructionBudget()).isTrue();
    }

    @Test
    @DisplayName("Builder 拒绝非法值")
    void invalidValues() {
        assertThatThrownBy(() -> VmOptions.custom().maxFrames(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VmOptions.custom().instructionBudget(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VmOptions.custom().checkInterval(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("从 classpath 上的 properties 读取")
    void fromProperties() throws Exception {
        Properties props = new Properties();
        try (InputStream in = VmOptionsTest.class.getResourceAsStream("/vm-limits.properties")) {
            assertThat(in).isNotNull();
            props.load(in);
        }
        VmOptions options = VmOptions.fromProperties(props);

        assertThat(options.getMaxFrames()).isEqualTo(64);
        assertThat(options.getMaxStackSize()).isEqualTo(65536);
        assertThat(options.getInstructionBudget()).isEqualTo(5000);
        assertThat(options.getCheckInterval()).isEqualTo(128);
    }

    @Test
    @DisplayName("非数字的配置值报告键名")
    void malformedProperty() {
        Properties props = new Properties();
        props.setProperty(VmOptions.MAX_STACK_SIZE, "lots");
        assertThatThrownBy(() -> VmOptions.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid value for pgs.vm.maxStackSize: 'lots'");
    }
}
