/*
 * Where: Watch channel layer
 * What: Builds the opening alert text shared by all channels
 * Why: Push, email and chat-bot must describe the same opening the same way
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.config.ChannelProperties;
import com.engagewatch.watch.model.ResourceStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class NotificationMessageFormatter {

  private final ChannelProperties properties;

  public NotificationMessage format(DeliveryRequest request) {
    final boolean restricted = request.status() == ResourceStatus.OPEN_RESTRICTED;
    final String kind = restricted ? "PARTICIPATION REQUEST" : "ENTRY";
    final String action = restricted ? "Request participation" : "Enter";
    final String subject = subjectOf(request);
    final String link =
        properties
            .resourceLinkTemplate()
            .replace("{resourceId}", Long.toString(request.resourceId()));

    final String title = subject + " is open (" + kind + ")";
    final String text = title + ". The \"" + action + "\" button is available: " + link;
    final String html =
        "<b>"
            + HtmlUtils.htmlEscape(subject)
            + " is open</b>\n"
            + "Type: "
            + kind
            + "\n"
            + "Action: \""
            + action
            + "\" button available\n"
            + "<a href=\""
            + HtmlUtils.htmlEscape(link)
            + "\">Open the competition page</a>";
    return new NotificationMessage(title, text, html, link);
  }

  private String subjectOf(DeliveryRequest request) {
    if (request.resourceName() == null || request.resourceName().isBlank()) {
      return "Competition " + request.resourceId();
    }
    return "Competition " + request.resourceId() + " " + request.resourceName();
  }
}
