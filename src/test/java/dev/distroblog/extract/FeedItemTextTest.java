package dev.distroblog.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FeedItemTextTest {

  private static final String LONG_BODY =
      "The project shipped a new installer today with support for encrypted disks and a faster first boot.";

  @Test
  void snippet_is_preferred_content() {
    RawItem item =
        RawItem.builder()
            .title("Installer update")
            .link("https://a.com/installer")
            .contentSnippet(LONG_BODY)
            .description("Short")
            .build();

    FeedItemText text = FeedItemText.from(item);

    assertThat(text.title()).isEqualTo("Installer update");
    assertThat(text.content()).isEqualTo(LONG_BODY);
  }

  @Test
  void body_in_title_is_swapped() {
    String body = "x".repeat(250);
    RawItem item = RawItem.builder().title(body).contentSnippet("Real title").build();

    FeedItemText text = FeedItemText.from(item);

    assertThat(text.title()).isEqualTo("Real title");
    assertThat(text.content()).isEqualTo(body);
  }

  @Test
  void url_in_title_is_swapped() {
    RawItem item =
        RawItem.builder()
            .title("https://a.com/post")
            .link("https://a.com/post")
            .contentSnippet("The actual headline")
            .build();

    FeedItemText text = FeedItemText.from(item);

    assertThat(text.title()).isEqualTo("The actual headline");
    assertThat(text.content()).isEqualTo("https://a.com/post");
  }

  @Test
  void overlong_title_is_cut_to_first_sentence() {
    String title = "Kernel lands with new schedulers and more. " + "More words follow here ".repeat(8);
    RawItem item = RawItem.builder().title(title).contentSnippet(LONG_BODY + " " + LONG_BODY).build();

    assertThat(FeedItemText.from(item).title()).isEqualTo("Kernel lands with new schedulers and more");
  }

  @Test
  void placeholder_content_is_replaced_by_the_link() {
    RawItem item =
        RawItem.builder().title("Some update title").link("https://a.com/p/1").description("Comments").build();

    FeedItemText text = FeedItemText.from(item);

    assertThat(text.content()).isEqualTo("https://a.com/p/1");
  }

  @Test
  void missing_title_is_untitled() {
    assertThat(FeedItemText.from(RawItem.builder().contentSnippet(LONG_BODY).build()).title())
        .isEqualTo("Untitled");
  }
}
