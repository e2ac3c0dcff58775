package com.dramacollector.collect.source;

import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Five fixed, fully populated records. Never fails for known ids and is the last stop of the
 * fallback chain.
 */
public class MockDramaSource implements DramaSource {
    private final SourceDescriptor descriptor;
    private final TokenBucketRateLimiter rateLimiter;
    private final Map<String, DramaAttributes> catalog;

    public MockDramaSource(SourceDescriptor descriptor) {
        this(descriptor, TokenBucketRateLimiter.unlimited());
    }

    public MockDramaSource(SourceDescriptor descriptor, TokenBucketRateLimiter rateLimiter) {
        this.descriptor = descriptor;
        this.rateLimiter = rateLimiter;
        this.catalog = buildCatalog();
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public List<RawRecord> fetchList(int count) throws SourceException, InterruptedException {
        rateLimiter.acquire();
        List<RawRecord> records = new ArrayList<>();
        for (Map.Entry<String, DramaAttributes> entry : catalog.entrySet()) {
            if (records.size() >= count) {
                break;
            }
            records.add(new RawRecord(name(), entry.getKey(), entry.getValue()));
        }
        if (records.size() < count) {
            throw new SourceExhaustedException(name(), count, records);
        }
        return records;
    }

    @Override
    public RawRecord fetchDetail(String sourceId) throws SourceException, InterruptedException {
        rateLimiter.acquire();
        DramaAttributes attributes = catalog.get(sourceId);
        if (attributes == null) {
            throw new SourceRejectedException(name(), "unknown id " + sourceId);
        }
        return new RawRecord(name(), sourceId, attributes);
    }

    public int catalogSize() {
        return catalog.size();
    }

    private static Map<String, DramaAttributes> buildCatalog() {
        Map<String, DramaAttributes> catalog = new LinkedHashMap<>();
        catalog.put("35267208", DramaAttributes.builder()
            .title("霸道总裁爱上我")
            .year(2024)
            .rating(8.2)
            .genres(List.of("爱情", "都市", "偶像"))
            .directors(List.of("张导演"))
            .casts(List.of("林晓雨", "陈俊豪", "王美丽", "李强"))
            .synopsis("普通职场女孩林晓雨意外成为大企业总裁陈俊豪的贴身秘书。冷酷霸道的总裁表面对她严厉，"
                + "实则内心早已被她的善良和真诚打动。在经历了误会、分离、重逢等一系列波折后，两人最终突破身份差距，收获了真挚的爱情。")
            .tags(List.of("霸总", "职场", "甜宠", "现代"))
            .episodes(24)
            .build());
        catalog.put("35267209", DramaAttributes.builder()
            .title("古装甜宠：王爷的小娇妻")
            .year(2024)
            .rating(7.8)
            .genres(List.of("古装", "爱情", "甜宠"))
            .directors(List.of("赵导演"))
            .casts(List.of("苏小小", "萧王爷", "柳如烟", "顾管家"))
            .synopsis("现代医学博士苏小小意外穿越到古代，成为丞相府的庶女。她用现代医术救了冷面王爷萧王爷一命，"
                + "从此两人命运纠缠。王爷被她的聪慧和医术吸引，苏小小也被他的温柔守护感动，在宫廷阴谋中携手成长，谱写甜蜜恋曲。")
            .tags(List.of("穿越", "古装", "甜宠", "王爷"))
            .episodes(30)
            .build());
        catalog.put("35267210", DramaAttributes.builder()
            .title("重生之娱乐圈女王")
            .year(2024)
            .rating(8.5)
            .genres(List.of("都市", "励志", "重生"))
            .directors(List.of("陈导演"))
            .casts(List.of("夏诗雨", "顾寒川", "林小娟", "张经纪人"))
            .synopsis("前世被闺蜜背叛、事业尽毁的女星夏诗雨重生回到出道前。这一世，她利用前世的经验和记忆，"
                + "重新规划演艺道路，不仅要在娱乐圈站稳脚跟，更要让那些伤害过她的人付出代价。在这个过程中，她遇到了真心守护她的制片人顾寒川。")
            .tags(List.of("重生", "娱乐圈", "复仇", "励志"))
            .episodes(36)
            .build());
        catalog.put("35267211", DramaAttributes.builder()
            .title("校园恋爱物语")
            .year(2024)
            .rating(7.6)
            .genres(List.of("校园", "青春", "爱情"))
            .directors(List.of("李导演"))
            .casts(List.of("叶青青", "林志轩", "张小雨", "王同学"))
            .synopsis("学霸女孩叶青青一直专注学习，直到遇到了阳光男孩林志轩。他是学校的篮球队长，成绩优异，人缘极好。"
                + "两人从互不相识到成为同桌，再到互相喜欢，在青春校园里演绎了一段纯美的初恋故事。")
            .tags(List.of("校园", "初恋", "青春", "学霸"))
            .episodes(20)
            .build());
        catalog.put("35267212", DramaAttributes.builder()
            .title("军婚甜宠：首长老公太霸道")
            .year(2024)
            .rating(8.0)
            .genres(List.of("军旅", "爱情", "甜宠"))
            .directors(List.of("周导演"))
            .casts(List.of("沈曼曼", "季司令", "赵副官", "李大嫂"))
            .synopsis("军医沈曼曼在一次军演中救治了重伤的神秘首长季司令。首长被她的专业和勇敢深深吸引，展开了猛烈的追求攻势。"
                + "从初时的抗拒到慢慢动心，沈曼曼发现这个看似严肃的军人首长私下里竟然如此温柔体贴。")
            .tags(List.of("军婚", "首长", "甜宠", "军医"))
            .episodes(28)
            .build());
        return catalog;
    }
}
