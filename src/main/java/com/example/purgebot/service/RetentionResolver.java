package com.example.purgebot.service;

import com.example.purgebot.model.CategoryConfig;
import com.example.purgebot.model.PurgeConfig;
import com.example.purgebot.model.ResolvedRetention;
import com.example.purgebot.model.RetentionSource;
import com.example.purgebot.model.RetentionValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 保留天数解析：频道内联覆盖 > 分类默认值 > 全局默认值。
 * 非法值回退到全局默认值并记录警告，从不抛异常。
 */
@Component
@Slf4j
public class RetentionResolver {

    public ResolvedRetention resolve(PurgeConfig config, String categoryName, String channelName) {
        int globalDefault = config.globalDefaultDays();
        CategoryConfig category = config.category(categoryName);
        if (category == null) {
            return new ResolvedRetention(globalDefault, RetentionSource.GLOBAL);
        }

        Optional<RetentionValue> override = category.findOverride(channelName);
        if (override.isPresent()) {
            return validate(override.get(), RetentionSource.OVERRIDE, categoryName + "/#" + channelName,
                    globalDefault);
        }
        if (category.getDefaultRetention() != null) {
            return validate(category.getDefaultRetention(), RetentionSource.CATEGORY, categoryName + "/default",
                    globalDefault);
        }
        return new ResolvedRetention(globalDefault, RetentionSource.GLOBAL);
    }

    private ResolvedRetention validate(RetentionValue value, RetentionSource source, String context,
                                       int globalDefault) {
        if (value.isValid()) {
            return new ResolvedRetention(value.getDays(), source);
        }
        log.warn("Invalid retention value \"{}\" for {}, using globalDefault ({})", value.getRaw(), context,
                globalDefault);
        return new ResolvedRetention(globalDefault, source);
    }
}
