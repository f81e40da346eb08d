package com.ai.quizbot.component;

import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    public String greeting() {
        return "नमस्ते! AEFI प्रशिक्षण बॉट में आपका स्वागत है 🙏\nक्या आप क्विज़ शुरू करना चाहेंगे?";
    }

    public String startButtonTitle() {
        return "शुरू करें ✅";
    }

    public String questionBody(int number, String text) {
        return "प्रश्न " + number + ": " + text;
    }

    public String chooseOptionButton() {
        return "विकल्प चुनें";
    }

    public String chooseAnswerSection() {
        return "उत्तर चुनें";
    }

    public String correctAnswer(String explanation) {
        return "✅ सही उत्तर!\n" + explanation;
    }

    public String incorrectAnswer(String correctOptionText, String explanation) {
        return "❌ गलत उत्तर।\n👉 सही उत्तर: " + correctOptionText + "\nℹ️ कारण: " + explanation;
    }

    public String completion(int score, int total) {
        return "🎉 प्रशिक्षण पूरा हुआ!\nआपका स्कोर: " + score + "/" + total;
    }

    public String noContent() {
        return "⚠️ कोई प्रश्न लोड नहीं हुआ। कृपया बाद में पुनः प्रयास करें।";
    }

    public String noExplanation() {
        return "कोई विवरण उपलब्ध नहीं।";
    }

    public String unknownAnswer() {
        return "उपलब्ध नहीं";
    }
}
