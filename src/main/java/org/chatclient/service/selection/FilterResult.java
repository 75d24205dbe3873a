package org.chatclient.service.selection;

import lombok.Value;

import java.util.List;

@Value
public class FilterResult {
    List<DisplayItem> displayItems;
    String noResultsMessage;   // null s'il y a des résultats
    boolean searching;
}
