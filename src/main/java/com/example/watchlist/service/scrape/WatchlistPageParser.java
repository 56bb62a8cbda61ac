package com.example.watchlist.service.scrape;

import com.example.watchlist.domain.MovieItem;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class WatchlistPageParser {
  static final String GRID_ITEM_SELECTOR = "li.griditem";
  static final String PAGINATION_MARKER_SELECTOR = "li.paginate-page";
  static final String FILM_ID_ATTR = "data-film-id";
  static final String DISPLAY_NAME_ATTR = "data-item-full-display-name";
  static final String SLUG_ATTR = "data-item-slug";

  public WatchlistPage parse(String html, String pageUrl) {
    Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
    List<MovieItem> movies = new ArrayList<>();
    for (Element gridItem : document.select(GRID_ITEM_SELECTOR)) {
      Element poster = gridItem.selectFirst("div");
      if (poster == null) {
        log.warn("Grid entry without poster element on {}", pageUrl);
        continue;
      }
      String id = poster.attr(FILM_ID_ATTR).trim();
      if (id.isEmpty()) {
        log.warn("Grid entry without {} on {}", FILM_ID_ATTR, pageUrl);
        continue;
      }
      movies.add(new MovieItem(id, poster.attr(DISPLAY_NAME_ATTR).trim(), poster.attr(SLUG_ATTR).trim()));
    }
    int markers = document.select(PAGINATION_MARKER_SELECTOR).size();
    log.debug("Parsed {} films and {} pagination markers from {}", movies.size(), markers, pageUrl);
    return new WatchlistPage(movies, markers);
  }
}
