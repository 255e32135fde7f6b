package io.firefeed.pipeline.api.service.feed;

import com.rometools.modules.mediarss.MediaEntryModule;
import com.rometools.modules.mediarss.MediaModule;
import com.rometools.modules.mediarss.types.MediaContent;
import com.rometools.modules.mediarss.types.MediaGroup;
import com.rometools.modules.mediarss.types.Metadata;
import com.rometools.modules.mediarss.types.Thumbnail;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import io.firefeed.pipeline.api.dto.MediaUrls;
import io.firefeed.pipeline.config.RssConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks one image and one video URL out of an already parsed entry.
 * <p>
 * Image order: Media RSS thumbnails, Media RSS image content, image enclosures,
 * then the first {@code <img src>} in the description or content. A video is taken from
 * video enclosures or Media RSS video content whose declared size is within the limit;
 * an unknown size is accepted.
 */
@Component
public class MediaExtractor {

    private final long maxVideoBytes;

    public MediaExtractor(RssConfig rssConfig) {
        this(rssConfig.processing().maxVideoBytes());
    }

    MediaExtractor(long maxVideoBytes) {
        this.maxVideoBytes = maxVideoBytes;
    }

    public MediaUrls extract(SyndEntry entry) {
        if (entry == null) {
            return MediaUrls.none();
        }
        return new MediaUrls(extractImage(entry), extractVideo(entry));
    }

    String extractImage(SyndEntry entry) {
        MediaEntryModule media = mediaModule(entry);
        if (media != null) {
            String thumbnail = firstThumbnail(media);
            if (thumbnail != null) return thumbnail;

            for (MediaContent content : allMediaContents(media)) {
                if (isImage(content)) {
                    String url = referenceUrl(content);
                    if (url != null) return url;
                }
            }
        }

        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            if (hasTypePrefix(enclosure.getType(), "image/") && isNotBlank(enclosure.getUrl())) {
                return enclosure.getUrl().trim();
            }
        }

        return firstInlineImage(entry);
    }

    String extractVideo(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            if (hasTypePrefix(enclosure.getType(), "video/")
                    && isNotBlank(enclosure.getUrl())
                    && withinSizeLimit(enclosure.getLength())) {
                return enclosure.getUrl().trim();
            }
        }

        MediaEntryModule media = mediaModule(entry);
        if (media != null) {
            for (MediaContent content : allMediaContents(media)) {
                if (isVideo(content) && withinSizeLimit(content.getFileSize())) {
                    String url = referenceUrl(content);
                    if (url != null) return url;
                }
            }
        }
        return null;
    }

    private MediaEntryModule mediaModule(SyndEntry entry) {
        if (entry.getModule(MediaModule.URI) instanceof MediaEntryModule module) {
            return module;
        }
        return null;
    }

    private String firstThumbnail(MediaEntryModule media) {
        List<Metadata> metadata = new ArrayList<>();
        if (media.getMetadata() != null) {
            metadata.add(media.getMetadata());
        }
        for (MediaContent content : allMediaContents(media)) {
            if (content.getMetadata() != null) {
                metadata.add(content.getMetadata());
            }
        }
        for (Metadata md : metadata) {
            Thumbnail[] thumbnails = md.getThumbnail();
            if (thumbnails == null) continue;
            for (Thumbnail thumbnail : thumbnails) {
                if (thumbnail.getUrl() != null) {
                    return thumbnail.getUrl().toString();
                }
            }
        }
        return null;
    }

    private List<MediaContent> allMediaContents(MediaEntryModule media) {
        List<MediaContent> contents = new ArrayList<>();
        if (media.getMediaContents() != null) {
            contents.addAll(List.of(media.getMediaContents()));
        }
        if (media.getMediaGroups() != null) {
            for (MediaGroup group : media.getMediaGroups()) {
                if (group.getContents() != null) {
                    contents.addAll(List.of(group.getContents()));
                }
            }
        }
        return contents;
    }

    private String firstInlineImage(SyndEntry entry) {
        // relative sources resolve against the entry link; unresolvable ones are skipped
        String baseUri = entry.getLink() == null ? "" : entry.getLink().trim();
        List<String> fragments = new ArrayList<>();
        if (entry.getDescription() != null) {
            fragments.add(entry.getDescription().getValue());
        }
        for (SyndContent content : entry.getContents()) {
            fragments.add(content.getValue());
        }

        for (String html : fragments) {
            if (html == null || !html.contains("<img")) continue;
            Element img = Jsoup.parseBodyFragment(html, baseUri).selectFirst("img[src]");
            String src = img == null ? null : img.attr("src", img.attr("src").trim()).absUrl("src");
            if (isNotBlank(src)) {
                return src;
            }
        }
        return null;
    }

    private boolean isImage(MediaContent content) {
        return "image".equalsIgnoreCase(content.getMedium()) || hasTypePrefix(content.getType(), "image/");
    }

    private boolean isVideo(MediaContent content) {
        return "video".equalsIgnoreCase(content.getMedium()) || hasTypePrefix(content.getType(), "video/");
    }

    private String referenceUrl(MediaContent content) {
        if (content.getReference() == null) return null;
        String url = content.getReference().toString();
        return isNotBlank(url) ? url.trim() : null;
    }

    private boolean withinSizeLimit(Long size) {
        return size == null || size <= 0 || size <= maxVideoBytes;
    }

    private static boolean hasTypePrefix(String type, String prefix) {
        return type != null && type.toLowerCase(Locale.ROOT).startsWith(prefix);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
