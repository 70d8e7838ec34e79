package org.csits.mig.manager.batch;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * 运行时间戳：yyyyMMddHHmmss_序号，用作账本与输出文件名后缀。
 * 序号在秒变化时归零；时钟回拨时沿用上一个秒值继续递增，保证文件名字典序与生成顺序一致。
 */
@Component
public class RunTimestampGenerator {

    private static final DateTimeFormatter SECOND = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    private String lastSecond = "";

    private int counter;

    public RunTimestampGenerator() {
        this(Clock.systemDefaultZone());
    }

    RunTimestampGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        String second = LocalDateTime.now(clock).format(SECOND);
        if (second.compareTo(lastSecond) > 0) {
            lastSecond = second;
            counter = 0;
        }
        counter++;
        return lastSecond + "_" + String.format("%03d", counter);
    }
}
