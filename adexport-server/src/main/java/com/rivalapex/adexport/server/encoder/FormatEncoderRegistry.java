package com.rivalapex.adexport.server.encoder;

import com.rivalapex.adexport.server.constants.ExportFormat;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 格式编码器注册与选择。
 */
@Component
@RequiredArgsConstructor
public class FormatEncoderRegistry {

    private final List<FormatEncoder> encoders;

    public FormatEncoder select(ExportFormat format) {
        return encoders.stream()
            .filter(e -> e.format() == format)
            .findFirst()
            .orElse(null);
    }
}
